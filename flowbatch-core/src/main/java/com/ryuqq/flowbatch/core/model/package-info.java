/**
 * Core domain model for batch runs.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.core.model.RunId} - Run unique identifier</li>
 *   <li>{@link com.ryuqq.flowbatch.core.model.LineInput} - One input record, indexed by its batch position</li>
 *   <li>{@link com.ryuqq.flowbatch.core.model.ErrorInfo} - Exception type name and message</li>
 * </ul>
 *
 * <h2>Flow Definition</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.core.model.FlowDefinition} - Declared inputs and nodes</li>
 *   <li>{@link com.ryuqq.flowbatch.core.model.InputDefinition} - Input name, type and default</li>
 *   <li>{@link com.ryuqq.flowbatch.core.model.NodeDefinition} - Node, optionally an aggregation node</li>
 *   <li>{@link com.ryuqq.flowbatch.core.model.ValueType} - Declared input types and coercion</li>
 * </ul>
 *
 * <h2>Results</h2>
 * <ul>
 *   <li>{@link com.ryuqq.flowbatch.core.model.LineResult} - Outcome of one line</li>
 *   <li>{@link com.ryuqq.flowbatch.core.model.AggregationResult} - Outcome of aggregation nodes</li>
 *   <li>{@link com.ryuqq.flowbatch.core.model.BatchResult} - Final immutable run summary</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> results never change after creation</li>
 *   <li><strong>Validation:</strong> constructors reject inconsistent state</li>
 *   <li><strong>Pure Java:</strong> no external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author FlowBatch Team
 */
package com.ryuqq.flowbatch.core.model;
