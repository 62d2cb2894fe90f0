/**
 * Typed channels and their type-erased base.
 *
 * <h2>Channel Family</h2>
 * <table border="1">
 *   <caption>Channel variants</caption>
 *   <tr><th>Arity</th><th>Void</th><th>Returning</th></tr>
 *   <tr><td>0</td><td>{@link com.ryuqq.signal.core.channel.Channel0}</td><td>{@link com.ryuqq.signal.core.channel.QueryChannel0}</td></tr>
 *   <tr><td>1</td><td>{@link com.ryuqq.signal.core.channel.Channel1}</td><td>{@link com.ryuqq.signal.core.channel.QueryChannel1}</td></tr>
 *   <tr><td>2</td><td>{@link com.ryuqq.signal.core.channel.Channel2}</td><td>{@link com.ryuqq.signal.core.channel.QueryChannel2}</td></tr>
 *   <tr><td>3</td><td>{@link com.ryuqq.signal.core.channel.Channel3}</td><td>{@link com.ryuqq.signal.core.channel.QueryChannel3}</td></tr>
 * </table>
 *
 * <h2>Arity Deficit</h2>
 * <p>Every variant offers an {@code attach} overload for each leading prefix of its
 * parameter list. The adapter drops trailing arguments at call time. A handler with more
 * parameters than the channel, or with incompatible leading types, has no matching overload
 * and is rejected by the compiler.</p>
 *
 * <h2>Erased Access</h2>
 * <p>Any variant can be held as {@code Channel<?>} and triggered with
 * {@code baseTrigger}, {@code baseQuery} or {@code dispatch}; the supplied values are checked
 * against the declared {@link com.ryuqq.signal.core.type.Signature} first.</p>
 *
 * <h2>Lifecycle</h2>
 * <pre>
 * new ChannelN(...) ──► [registry.notifyConstruct]
 *        │
 *        ├──► attach / remove / trigger   (any number of times)
 *        │
 *        └──► destroy() ──► clear() ──► notifyDestruct on every non-primary registry
 * </pre>
 *
 * @since 1.0.0
 * @author Signal Team
 */
package com.ryuqq.signal.core.channel;
