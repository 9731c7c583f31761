package com.patterns.builder.member;

/**
 * Faceted Builder -- root facade over a single {@link Member}.
 *
 * {@link #address()} and {@link #works()} return narrow facades that write to
 * the same instance. Since every facade is itself a MemberBuilder, a chain can
 * hop between facades at any point:
 *
 * <pre>
 * Member m = new MemberBuilder()
 *         .address().at("123 London Road").in("London")
 *         .works().at("Acme").earning(3000)
 *         .build();
 * </pre>
 */
public class MemberBuilder {
    // Shared by reference with every facade created from this builder
    protected final Member member;

    public MemberBuilder() {
        this(new Member());
    }

    protected MemberBuilder(Member member) {
        this.member = member;
    }

    public MemberAddressBuilder address() {
        return new MemberAddressBuilder(member);
    }

    public MemberJobBuilder works() {
        return new MemberJobBuilder(member);
    }

    /**
     * Returns the shared member itself, not a copy. Further facade calls keep
     * mutating the returned instance.
     */
    public Member build() {
        return member;
    }
}
