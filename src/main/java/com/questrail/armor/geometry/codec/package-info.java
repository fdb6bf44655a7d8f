/**
 * Armor Geometry Codec: Public Boundary
 * =============================================================================
 *
 * <p>This package defines the <strong>codec boundary</strong> for the armor
 * section of geometry containers: the encoder and decoder ports, their result
 * types, and the failures they report.</p>
 *
 * <h2>Container layout</h2>
 * <pre>
 *   0x00  fill (0xFF) x 20
 *   0x14  armor block count          u32 LE   (0 or 1)
 *   ....  fill (0xFF) up to 0x40
 *   0x40  armor section position     u32 LE, then 4 zero bytes
 *   ....  fill (0xFF) up to the armor section
 *
 *   armor section
 *     +0x00  content length           u32 LE, then 4 zero bytes
 *     +0x08  section name length      u32 LE (19), then 4 zero bytes
 *     +0x10  section name position    u32 LE, relative to +0x08, then 4 zero bytes
 *     +0x18  content region
 *              opaque x 36
 *              piece count            u32 LE
 *              per piece: id u32 LE, opaque x 24, vertex count u32 LE,
 *                         per vertex: x, y, z f32 LE, opaque x 4
 *     ....   section name             "CM_PA_united.armor\0"
 * </pre>
 *
 * <p>Opaque regions are written as {@code 0xFF} and skipped on read. With no
 * armor block the container ends right after the section position field
 * (0x44 bytes).</p>
 *
 * <h2>Architectural Placement</h2>
 * <pre>
 *   ArmorRecord
 *        → ArmorGeometryEncoder   → EncodedArmorGeometry (bytes + metadata)
 *   byte[]
 *        → ArmorGeometryDecoder   → DecodedArmorGeometry (record + metadata)
 * </pre>
 *
 * <p>Concrete implementations live in {@code codec.impl}. Netty buffer types
 * used there never cross this boundary.</p>
 */
package com.questrail.armor.geometry.codec;
