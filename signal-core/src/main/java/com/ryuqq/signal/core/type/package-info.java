/**
 * Runtime type identity used by the type-erased dispatch path.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.signal.core.type.TypeDescriptor} - interned, comparable identifier of a Java type</li>
 *   <li>{@link com.ryuqq.signal.core.type.Signature} - declared return and parameter descriptors of a channel or action</li>
 * </ul>
 *
 * <h2>Relaxed Matching</h2>
 * <p>Wrapper types reduce to their primitive ({@code Integer} to {@code int}), so a channel
 * declared over {@code int} accepts boxed values coming through {@code Object...} varargs.
 * A {@code null} value matches any non-primitive parameter.</p>
 *
 * @since 1.0.0
 * @author Signal Team
 */
package com.ryuqq.signal.core.type;
