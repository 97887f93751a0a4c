/**
 * Serialization of entity graphs.
 *
 * <ul>
 *   <li>{@link com.msb.serializer.EntitySerializer} – {@code serialize}/{@code deserialize} for entities
 *       and containers; cycle-safe, bounded, without recursion</li>
 *   <li>{@link com.msb.serializer.SerializedForm} – form keys and {@code $ref} reference markers</li>
 *   <li>{@link com.msb.serializer.SerializerOptions} – {@link com.msb.serializer.CyclePolicy},
 *       {@link com.msb.serializer.SharedReferencePolicy}, node bound, dangling-reference handling</li>
 *   <li>{@link com.msb.serializer.json.EntityJson} – JSON text for serialized forms</li>
 * </ul>
 */
package com.msb.serializer;
