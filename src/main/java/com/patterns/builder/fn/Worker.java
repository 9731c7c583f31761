package com.patterns.builder.fn;

import lombok.Data;

@Data
public class Worker {
    private String name;
    private String position;
}
