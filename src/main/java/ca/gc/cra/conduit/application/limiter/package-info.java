/**
 * Token-bucket admission control consulted before a sender item is fetched.
 */
package ca.gc.cra.conduit.application.limiter;
