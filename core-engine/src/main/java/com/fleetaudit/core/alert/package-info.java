/**
 * Raising alerts from rules and rolling them up into health and summary
 * counts.
 *
 * @since 1.0.0
 */
package com.fleetaudit.core.alert;
