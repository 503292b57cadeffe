/**
 * Reads JSON and YAML documents with Jackson.
 */
package works.confit.jackson;
