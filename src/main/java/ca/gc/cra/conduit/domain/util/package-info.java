/**
 * Small domain helpers.
 */
package ca.gc.cra.conduit.domain.util;
