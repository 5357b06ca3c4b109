/**
 * Manifest derivation from an Event and a Policy snapshot.
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.core.manifest;
