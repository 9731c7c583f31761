package com.patterns.builder.member;

import lombok.Data;

/**
 * Mutable record shared by every facade of one {@link MemberBuilder}.
 */
@Data
public class Member {
    // address
    private String streetAddress;
    private String postcode;
    private String city;

    // employment
    private String companyName;
    private String position;
    private int annualIncome;
}
