/**
 * Exceptions that can reach the user of the core API.
 */
package works.mongobridge.exceptions;
