package com.landawn.abacus.redis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Builder
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Account {

    private long id;
    private String gui;
    private String emailAddress;
    private String firstName;
    private String lastName;
    private int status;

}
