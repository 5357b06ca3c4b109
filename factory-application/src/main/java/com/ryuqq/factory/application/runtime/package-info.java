/**
 * Runtime port for the periodic poll loop.
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.application.runtime;
