package com.swiftship.core.ast;

import java.util.Objects;

/**
 * Member access. A null base is an implicit member expression such as {@code .leading}.
 *
 * @param base the receiver, or null for implicit member access
 * @param member member name
 */
public record MemberAccessExpr(Expression base, String member) implements Expression {

    public MemberAccessExpr {
        Objects.requireNonNull(member, "member must not be null");
    }

    /**
     * Creates an implicit member expression ({@code .member}).
     *
     * @param member member name
     * @return the expression
     */
    public static MemberAccessExpr implicit(String member) {
        return new MemberAccessExpr(null, member);
    }

    @Override
    public <R> R accept(SwiftNodeVisitor<R> visitor) {
        return visitor.visitMemberAccess(this);
    }
}
