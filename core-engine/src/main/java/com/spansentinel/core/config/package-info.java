/**
 * YAML-based loading and validation of detection rules.
 *
 * @since 1.0.0
 */
package com.spansentinel.core.config;
