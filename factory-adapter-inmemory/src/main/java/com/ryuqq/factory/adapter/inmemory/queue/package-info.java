/**
 * In-memory EventQueue adapter implementation package.
 *
 * @see com.ryuqq.factory.core.spi.EventQueue
 * @author Factory Team
 * @since 1.0.0
 */
package com.ryuqq.factory.adapter.inmemory.queue;
