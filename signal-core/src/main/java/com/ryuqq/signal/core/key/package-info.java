/**
 * Subscription handles returned by channels on attach.
 *
 * @since 1.0.0
 * @author Signal Team
 */
package com.ryuqq.signal.core.key;
