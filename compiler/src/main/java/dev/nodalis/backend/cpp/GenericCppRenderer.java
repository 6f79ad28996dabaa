package dev.nodalis.backend.cpp;

import dev.nodalis.backend.Literals;
import dev.nodalis.backend.LogicalOperatorStyle;
import dev.nodalis.st.ast.BitAccess;
import dev.nodalis.st.ast.VariableDeclaration;

import java.util.Optional;

/**
 * C++ for the {@code imperium.h} runtime, which has no {@code RefVar} and no
 * bit helpers. Located variables are read and written through the address
 * functions on every access, bits are selected with shifts, and logical
 * operators are bitwise.
 */
final class GenericCppRenderer extends CppRenderer {

    GenericCppRenderer() {
        super(GenericCppBackend.NAME, LogicalOperatorStyle.BITWISE);
    }

    @Override
    protected Optional<String> declare(VariableDeclaration variable, String storage) {
        if (isLocated(variable)) {
            return Optional.empty();
        }
        return super.declare(variable, storage);
    }

    @Override
    protected String readLocated(VariableDeclaration variable, String reference) {
        return "readAddress(" + address(variable) + ")";
    }

    @Override
    protected String writeLocated(VariableDeclaration variable, String reference, String value) {
        return "writeAddress(" + address(variable) + ", " + value + ");";
    }

    @Override
    protected String readBit(BitAccess access, String target) {
        return "((" + source(access, target) + " >> " + access.getBit() + ") & 1)";
    }

    @Override
    protected String writeBit(BitAccess access, String target, String value) {
        String mask = "(1ULL << " + access.getBit() + ")";
        String updated = "(" + value + ") ? (" + source(access, target) + " | " + mask + ") : ("
                + source(access, target) + " & ~" + mask + ")";
        Optional<VariableDeclaration> located = locatedTarget(access);
        if (located.isPresent()) {
            return "writeAddress(" + address(located.get()) + ", " + updated + ");";
        }
        return target + " = " + updated + ";";
    }

    private String source(BitAccess access, String target) {
        return locatedTarget(access).map(this::readAddressOf).orElse(target);
    }

    private String readAddressOf(VariableDeclaration variable) {
        return "readAddress(" + address(variable) + ")";
    }

    private Optional<VariableDeclaration> locatedTarget(BitAccess access) {
        return declarationOf(access.getTarget()).filter(variable -> isLocated(variable));
    }

    private static String address(VariableDeclaration variable) {
        return Literals.quote(variable.getAddress().orElseThrow());
    }
}
