/**
 * Restricted arithmetic over field placeholders.
 */
package com.fleetaudit.core.expression;
