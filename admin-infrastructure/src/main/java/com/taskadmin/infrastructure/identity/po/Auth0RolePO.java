package com.taskadmin.infrastructure.identity.po;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Auth0RolePO {

    private String id;

    private String name;

    private String description;
}
