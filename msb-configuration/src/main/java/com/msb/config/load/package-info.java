/**
 * Schema catalog files: Jackson binding, and loading from the schema directory or the classpath.
 */
package com.msb.config.load;
