/**
 * Failure taxonomy shared by entities, containers and the serializer. All are unchecked and
 * carry the location of the failure; partial results are never returned alongside them.
 */
package com.msb.entity.error;
