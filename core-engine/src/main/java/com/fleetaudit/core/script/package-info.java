/**
 * Helper scripts that compute field values in a child process.
 *
 * @since 1.0.0
 */
package com.fleetaudit.core.script;
