/**
 * Logback-specific logging utilities.
 */
package works.mongobridge.logback;
