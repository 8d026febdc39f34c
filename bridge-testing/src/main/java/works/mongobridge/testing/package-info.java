/**
 * Test support shared by the other modules: a loop that runs on the test thread,
 * a recorder for {@link works.mongobridge.Deferred} reactions, and a base test class.
 */
package works.mongobridge.testing;
