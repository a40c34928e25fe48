/**
 * Minimizes generated code by leaving out fields that already hold their default values.
 */
package works.scenegen.diff;
