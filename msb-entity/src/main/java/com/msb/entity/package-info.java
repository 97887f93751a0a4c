/**
 * Entities and their schemas.
 *
 * <ul>
 *   <li>{@link com.msb.entity.Entity} – named, typed record validated against its schema</li>
 *   <li>{@link com.msb.entity.schema} – {@link com.msb.entity.schema.EntitySchema} per kind,
 *       {@link com.msb.entity.schema.AttributeDef} declarations and the
 *       {@link com.msb.entity.schema.SchemaRegistry}</li>
 *   <li>{@link com.msb.entity.container} – insertion-ordered, kind-scoped
 *       {@link com.msb.entity.container.EntityContainer}</li>
 *   <li>{@link com.msb.entity.error} – failure taxonomy</li>
 * </ul>
 */
package com.msb.entity;
