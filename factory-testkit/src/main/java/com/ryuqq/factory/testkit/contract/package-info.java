/**
 * Abstract SPI contract tests.
 *
 * <p>Adapter modules extend these classes and provide the implementation under test, so every
 * Store and EventQueue implementation is held to the same behaviour.</p>
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.testkit.contract;
