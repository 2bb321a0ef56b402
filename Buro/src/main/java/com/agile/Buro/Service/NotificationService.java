package com.agile.Buro.Service;

import com.agile.Buro.Models.NotiModel;
import com.agile.Buro.dto.NotificationRequest;
import com.agile.Buro.entity.NotiEntity;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.NotificationNotFoundException;
import com.agile.Buro.repository.NotiRepository;
import com.agile.Buro.repository.UsersRepository;
import com.agile.Buro.util.Mappers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * In-app inbox. Rows are written by {@link NotificationWorker}; users read and clear
 * only their own.
 */
@Slf4j
@Service
public class NotificationService {

    private final NotiRepository notiRepository;
    private final UsersRepository usersRepository;

    public NotificationService(NotiRepository notiRepository, UsersRepository usersRepository) {
        this.notiRepository = notiRepository;
        this.usersRepository = usersRepository;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Optional<NotiEntity> store(NotificationRequest request) {
        Optional<UsersEntity> recipient = usersRepository.findById(request.recipientId());
        if (recipient.isEmpty()) {
            log.debug("Recipient {} no longer exists, notification dropped", request.recipientId());
            return Optional.empty();
        }
        NotiEntity noti = new NotiEntity();
        noti.setRecipient(recipient.get());
        noti.setTypeNoti(request.type());
        noti.setSubject(request.subject());
        noti.setMessage(request.body());
        noti.setIssueKey(request.issueKey());
        noti.setRead(false);
        return Optional.of(notiRepository.save(noti));
    }

    @Transactional(readOnly = true)
    public List<NotiModel> listFor(UsersEntity user, boolean unreadOnly) {
        List<NotiEntity> rows = unreadOnly
                ? notiRepository.findByRecipient_UserIdAndReadFalseOrderByCreatedAtDesc(user.getUserId())
                : notiRepository.findByRecipient_UserIdOrderByCreatedAtDesc(user.getUserId());
        return rows.stream().map(Mappers::toNotiModel).toList();
    }

    @Transactional
    public NotiModel markAsRead(UsersEntity user, UUID notiId) {
        NotiEntity noti = notiRepository.findByNotiIdAndRecipient_UserId(notiId, user.getUserId())
                .orElseThrow(NotificationNotFoundException::new);
        noti.setRead(true);
        return Mappers.toNotiModel(notiRepository.save(noti));
    }

    @Transactional
    public int markAllAsRead(UsersEntity user) {
        return notiRepository.markAllRead(user.getUserId());
    }

    @Transactional
    public void delete(UsersEntity user, UUID notiId) {
        NotiEntity noti = notiRepository.findByNotiIdAndRecipient_UserId(notiId, user.getUserId())
                .orElseThrow(NotificationNotFoundException::new);
        notiRepository.delete(noti);
    }
}
