/**
 * Session configuration: {@link com.dualedit.config.DualEditConfig}, read from {@code DUALEDIT_*} environment
 * variables or built directly.
 */
package com.dualedit.config;
