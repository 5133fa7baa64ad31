package org.jfront.frontend.parser.ast;

import org.jfront.frontend.lexer.Position;

import java.util.List;

/**
 * A name or field access. A leading dotted name such as {@code a.b.c} keeps
 * {@code a.b} as the qualifier and {@code c} as the member.
 *
 * @param position Where the name begins.
 * @param qualifier The dotted qualifier, or {@code null}.
 * @param member The referenced name.
 * @param selectors The selectors that follow.
 */
public record MemberReference(
        Position position,
        String qualifier,
        String member,
        List<Selector> selectors
) implements Primary, Selector {

    public MemberReference {
        selectors = NodeLists.copyOf(selectors);
    }
}
