/**
 * Cooperative cancellation for batch runs.
 *
 * <p>{@link com.ryuqq.flowbatch.core.cancel.CancellationToken} is created per run and
 * passed to the scheduler and the supervisor at construction. Both select on its signal
 * alongside completion events instead of polling a shared flag.</p>
 *
 * @since 1.0.0
 * @author FlowBatch Team
 */
package com.ryuqq.flowbatch.core.cancel;
