/**
 * Service Provider Interfaces for the batch orchestrator's external collaborators.
 *
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.core.spi.ExecutorFactory} - creates a backend per flow kind</li>
 *   <li>{@link com.ryuqq.flowbatch.core.spi.InputResolver} - input dirs + mapping to line rows</li>
 *   <li>{@link com.ryuqq.flowbatch.core.spi.OutputWriter} - persists successful line outputs</li>
 * </ul>
 *
 * <p>Implementations live in adapter modules (adapter-inmemory, adapter-file).</p>
 *
 * @author FlowBatch Team
 * @since 1.0.0
 */
package com.ryuqq.flowbatch.core.spi;
