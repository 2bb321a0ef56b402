package com.agile.Buro.Models;

import com.agile.Buro.entity.NotiType;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class NotiModel {
    private UUID notiId;
    private NotiType typeNoti;
    private String subject;
    private String message;
    private String issueKey;
    private boolean read;
    private LocalDateTime createdAt;
}
