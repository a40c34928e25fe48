/**
 * Mechanical pieces of source generation with no knowledge of scene graphs.
 */
package works.scenegen.codegen;
