package com.patterns.builder.member;

/**
 * Address facade.
 */
public class MemberAddressBuilder extends MemberBuilder {

    MemberAddressBuilder(Member member) {
        super(member);
    }

    public MemberAddressBuilder at(String streetAddress) {
        member.setStreetAddress(streetAddress);
        return this;
    }

    public MemberAddressBuilder withPostcode(String postcode) {
        member.setPostcode(postcode);
        return this;
    }

    public MemberAddressBuilder in(String city) {
        member.setCity(city);
        return this;
    }
}
