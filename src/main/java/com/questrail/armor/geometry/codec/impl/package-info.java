/**
 * Armor Geometry Codec: Wire-Level Implementation
 * =============================================================================
 *
 * <p>This package contains the concrete encoder and decoder for the armor
 * section of geometry containers.</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   ArmorRecord
 *        → DefaultArmorGeometryEncoder
 *            → content region (own buffer) → ArmorContentDigest
 *            → header + section header + content + section name
 *        → EncodedArmorGeometry
 *
 *   byte[]
 *        → DefaultArmorGeometryDecoder
 *            → block count, section pointer, section header
 *            → pieces and vertex records
 *            → length/position consistency, section name, ArmorContentDigest
 *        → DecodedArmorGeometry
 * </pre>
 *
 * <h2>Netty containment rule</h2>
 * <p>Netty {@code ByteBuf}s are used here for little-endian field access. They
 * are unpooled, released before returning, and never escape this package;
 * only {@code byte[]} crosses the codec boundary.</p>
 *
 * <p>Any failure at this layer aborts the whole call.</p>
 */
package com.questrail.armor.geometry.codec.impl;
