package works.confit.mapping.spec;

/**
 * Supplies the value of a {@link RecordMember} whose key is absent from the configuration.
 * Evaluated separately for every absence; nothing is computed ahead of time.
 */
public sealed interface DefaultSpec permits ComputedSpec, DefaultLiteral {
}
