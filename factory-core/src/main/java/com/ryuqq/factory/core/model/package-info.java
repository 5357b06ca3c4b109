/**
 * Domain model: Event, Policy, Manifest, Run, Chamber, Receipt and their value types.
 *
 * <p>Immutable values are records validated in their compact constructors. Run and Chamber are
 * the only mutable types; their mutators are synchronized.</p>
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.core.model;
