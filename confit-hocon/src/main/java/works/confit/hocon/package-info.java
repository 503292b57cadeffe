/**
 * Reads HOCON, JSON and properties documents with Typesafe Config.
 */
package works.confit.hocon;
