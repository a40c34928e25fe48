/**
 * Decides how each reference field is reproduced: by construction,
 * by reuse of an existing variable, or by lookup under an anchor boundary.
 */
package works.scenegen.refs;
