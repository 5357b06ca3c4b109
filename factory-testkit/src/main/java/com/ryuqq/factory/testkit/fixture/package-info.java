/**
 * Shared domain fixtures (events, manifests, gate results, receipts).
 *
 * @author Factory Team
 * @since 1.0.0
 */
package com.ryuqq.factory.testkit.fixture;
