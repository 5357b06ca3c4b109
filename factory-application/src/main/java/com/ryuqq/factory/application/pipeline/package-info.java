/**
 * Pipeline port: drives a single Run through Foster, Develop and Hone.
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.application.pipeline;
