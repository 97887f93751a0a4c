/**
 * Environment-driven configuration: serializer policies and the location of the schema catalog.
 */
package com.msb.config;
