package com.taskadmin.api.dto;

import lombok.Data;

import java.util.List;

/**
 * 用户分页 DTO。
 */
@Data
public class UserPageDTO {

    private List<UserDTO> users;
    private Long total;
    private Integer page;
    private Integer pageSize;
}
