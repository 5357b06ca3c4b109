/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Collaborator contracts the controller and pipeline depend on. Adapter modules provide the
 * implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.factory.core.spi.CostEstimator} - scope → token/cost estimate</li>
 *   <li>{@link com.ryuqq.factory.core.spi.ContextRetriever} - scope → related prior work</li>
 *   <li>{@link com.ryuqq.factory.core.spi.StepExecutor} - Develop step → artifact content</li>
 *   <li>{@link com.ryuqq.factory.core.spi.VerificationCheck} - gate → verdict</li>
 *   <li>{@link com.ryuqq.factory.core.spi.Store} - Manifest/Run/Chamber/Receipt repository</li>
 *   <li>{@link com.ryuqq.factory.core.spi.EventQueue} - FIFO backlog of deferred events</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Dependency Inversion:</strong> Core does not depend on infrastructure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.core.spi;
