/**
 * Controller port: event ingestion, policy enforcement, approvals and status reporting.
 *
 * @since 1.0.0
 * @author Factory Team
 */
package com.ryuqq.factory.application.controller;
