/**
 * Scriptable collaborator stubs.
 *
 * <p>Each stub implements one core SPI (cost estimation, context retrieval, step execution,
 * gate verification) and records its calls so tests can assert on how the pipeline used it.</p>
 *
 * @author Factory Team
 * @since 1.0.0
 */
package com.ryuqq.factory.testkit.stub;
