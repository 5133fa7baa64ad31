package org.jfront.frontend.parser.ast;

import java.util.List;

/**
 * A class, interface, enum, record or annotation type declaration.
 */
public interface TypeDeclaration extends Declaration, Member {

    String name();

    /**
     * @return The member declarations of the body. For enums, the declarations after the constants.
     */
    List<Member> body();
}
