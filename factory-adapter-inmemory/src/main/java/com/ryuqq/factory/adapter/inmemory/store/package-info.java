/**
 * In-memory Store adapter implementation package.
 *
 * <p>Provides {@link com.ryuqq.factory.adapter.inmemory.store.InMemoryStore}, a thread-safe
 * implementation of {@link com.ryuqq.factory.core.spi.Store} backed by concurrent maps.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Suitable for Contract Tests and single-process deployments</li>
 * </ul>
 *
 * @see com.ryuqq.factory.core.spi.Store
 * @author Factory Team
 * @since 1.0.0
 */
package com.ryuqq.factory.adapter.inmemory.store;
