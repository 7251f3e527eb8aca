package ai.mapper.scip;

/**
 * One element of a symbol's descriptor chain.
 *
 * @param name          unescaped name
 * @param disambiguator method overload disambiguator, empty when absent
 * @param suffix        grammar suffix that terminated the element
 * @param start         offset of the element inside the full symbol string
 */
public record Descriptor(
        String name,
        String disambiguator,
        Suffix suffix,
        int start
) {

    public enum Suffix {
        NAMESPACE,       // name/
        TYPE,            // name#
        TERM,            // name.
        METHOD,          // name(disambiguator).
        TYPE_PARAMETER,  // [name]
        PARAMETER,       // (name)
        META,            // name:
        MACRO            // name!
    }
}
