/**
 * Exceptions describing why a configuration tree could not be decoded.
 * <p>
 * Every exception carries the {@link works.confit.tree.ConfigPath ConfigPath}
 * at which the problem was detected.
 * Failures of unions and open-polymorphic types are composites
 * ({@link works.confit.exceptions.TypeConfigException}) that retain the failure
 * of each candidate, in the order the candidates were tried.
 */
package works.confit.exceptions;
