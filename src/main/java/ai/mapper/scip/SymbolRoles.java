package ai.mapper.scip;

import java.util.EnumSet;
import java.util.Set;

/**
 * Bits of an occurrence's {@code symbolRoles} mask.
 */
public enum SymbolRoles {
    DEFINITION(0x1),
    IMPORT(0x2),
    WRITE_ACCESS(0x4),
    READ_ACCESS(0x8),
    GENERATED(0x10),
    TEST(0x20),
    FORWARD_DEFINITION(0x40);

    private final int bit;

    SymbolRoles(int bit) {
        this.bit = bit;
    }

    public boolean isSet(int mask) {
        return (mask & bit) != 0;
    }

    /**
     * Decodes a mask; an empty set is a plain reference.
     */
    public static Set<SymbolRoles> decode(int mask) {
        final Set<SymbolRoles> roles = EnumSet.noneOf(SymbolRoles.class);
        for (SymbolRoles role : values()) {
            if (role.isSet(mask)) {
                roles.add(role);
            }
        }
        return roles;
    }
}
