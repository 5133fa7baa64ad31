package org.jfront.frontend.parser.ast;

import java.util.List;

/**
 * A primary expression followed by its selectors, e.g. {@code foo.bar()[0].baz}
 * is a {@link MethodInvocation} whose selectors are an {@link ArraySelector} and a {@link MemberReference}.
 */
public interface Primary extends Expression {

    /**
     * @return The selectors applied to this primary, in source order.
     */
    List<Selector> selectors();
}
