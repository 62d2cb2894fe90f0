/**
 * Service Provider Interface (SPI) package.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.signal.core.spi.ChannelRegistry} - channel construction/destruction notifications</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>The signal-control module provides {@code ChannelManager}, an owner-scoped registry
 * that tracks channels by name. Applications may add their own registries (metrics,
 * diagnostics) by implementing the same two methods.</p>
 *
 * @since 1.0.0
 * @author Signal Team
 */
package com.ryuqq.signal.core.spi;
