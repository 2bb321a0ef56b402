package com.agile.Buro.Models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ProjectMemberModel {
    private UserRef user;
    private boolean owner;
    private LocalDateTime addedAt;
}
