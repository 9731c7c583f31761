package com.patterns.builder.member;

/**
 * Employment facade.
 */
public class MemberJobBuilder extends MemberBuilder {

    MemberJobBuilder(Member member) {
        super(member);
    }

    public MemberJobBuilder at(String companyName) {
        member.setCompanyName(companyName);
        return this;
    }

    public MemberJobBuilder asA(String position) {
        member.setPosition(position);
        return this;
    }

    public MemberJobBuilder earning(int annualIncome) {
        member.setAnnualIncome(annualIncome);
        return this;
    }
}
