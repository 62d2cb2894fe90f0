/**
 * Handler storage and adaptation.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.signal.core.handler.Handler} - erased call form stored by channels</li>
 *   <li>{@link com.ryuqq.signal.core.handler.Handlers} - adapter builder, typed callable to {@code Handler}, drops trailing arguments</li>
 *   <li>{@link com.ryuqq.signal.core.handler.HandlerSet} - ordered, copy-on-write handler list</li>
 *   <li>{@link com.ryuqq.signal.core.handler.TriConsumer}, {@link com.ryuqq.signal.core.handler.TriFunction} - three-argument callables</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Signal Team
 */
package com.ryuqq.signal.core.handler;
