package com.agile.Buro.Service;

import com.agile.Buro.Config.BuroProperties;
import com.agile.Buro.Models.UserModel;
import com.agile.Buro.TestFixtures;
import com.agile.Buro.dto.UserUpdate;
import com.agile.Buro.entity.UserRole;
import com.agile.Buro.entity.UsersEntity;
import com.agile.Buro.exception.ForbiddenOperationException;
import com.agile.Buro.exception.InvalidInputException;
import com.agile.Buro.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserServiceTest {

    @Mock private UsersRepository usersRepository;
    @Mock private ProjectsRepository projectsRepository;
    @Mock private ProjectMembersRepository membersRepository;
    @Mock private IssuesRepository issuesRepository;
    @Mock private NotiRepository notiRepository;
    @Mock private RefreshTokenService refreshTokenService;
    @Mock private PasswordEncoder encoder;

    private UserService userService;

    private final UsersEntity admin = TestFixtures.user(UserRole.ADMIN);
    private final UsersEntity manager = TestFixtures.user(UserRole.MANAGER);
    private final UsersEntity developer = TestFixtures.user(UserRole.DEVELOPER);

    @BeforeEach
    void setUp() {
        userService = new UserService(usersRepository, projectsRepository, membersRepository, issuesRepository,
                notiRepository, refreshTokenService, new AccessPolicy(new OpenMembershipLookup()), encoder,
                new BuroProperties());
    }

    @Test
    void deactivateSelf_isInvalid() {
        when(usersRepository.findById(admin.getUserId())).thenReturn(Optional.of(admin));

        assertThatThrownBy(() -> userService.deactivate(admin.getUserId(), admin))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void managerCannotDeactivate() {
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));

        assertThatThrownBy(() -> userService.deactivate(developer.getUserId(), manager))
                .isInstanceOf(ForbiddenOperationException.class);
        assertThat(developer.isActive()).isTrue();
    }

    @Test
    void adminDeactivates_andSessionsAreRevoked() {
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));
        when(usersRepository.save(developer)).thenReturn(developer);

        UserModel result = userService.deactivate(developer.getUserId(), admin);

        assertThat(result.isActive()).isFalse();
        verify(refreshTokenService).revokeAll(developer);
    }

    @Test
    void managerEditingDeveloper_cannotChangeRole() {
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));

        UserUpdate update = UserUpdate.builder().role(UserRole.ADMIN).build();

        assertThatThrownBy(() -> userService.updateUser(developer.getUserId(), update, manager))
                .isInstanceOf(ForbiddenOperationException.class);
        assertThat(developer.getRole()).isEqualTo(UserRole.DEVELOPER);
    }

    @Test
    void sameRole_isNotARoleChange() {
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));
        when(usersRepository.save(developer)).thenReturn(developer);

        UserUpdate update = UserUpdate.builder().role(UserRole.DEVELOPER).fullName("  Renamed ").build();
        UserModel result = userService.updateUser(developer.getUserId(), update, developer);

        assertThat(result.getFullName()).isEqualTo("Renamed");
        verifyNoInteractions(refreshTokenService);
    }

    @Test
    void fullNameOverColumnLength_isInvalid() {
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));
        String original = developer.getFullName();

        UserUpdate update = UserUpdate.builder().fullName("n".repeat(UsersEntity.MAX_NAME_LENGTH + 1)).build();

        assertThatThrownBy(() -> userService.updateUser(developer.getUserId(), update, developer))
                .isInstanceOf(InvalidInputException.class);
        assertThat(developer.getFullName()).isEqualTo(original);
        verify(usersRepository, never()).save(any());
    }

    @Test
    void avatarUrlOverColumnLength_isInvalid() {
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));

        UserUpdate update = UserUpdate.builder()
                .avatarUrl("https://cdn.buro.test/" + "a".repeat(UsersEntity.MAX_AVATAR_URL_LENGTH)).build();

        assertThatThrownBy(() -> userService.updateUser(developer.getUserId(), update, developer))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void developerCannotListUsers() {
        assertThatThrownBy(() -> userService.listUsers(null, 0, 10, developer))
                .isInstanceOf(ForbiddenOperationException.class);
    }

    @Test
    void deleteUser_removesDependentsBeforeTheUser() {
        when(usersRepository.findById(developer.getUserId())).thenReturn(Optional.of(developer));
        when(projectsRepository.findByOwner_UserId(developer.getUserId())).thenReturn(List.of());

        userService.deleteUser(developer.getUserId(), admin);

        InOrder order = inOrder(refreshTokenService, notiRepository, membersRepository, projectsRepository,
                issuesRepository, usersRepository);
        order.verify(refreshTokenService).revokeAll(developer);
        order.verify(notiRepository).deleteByRecipientId(developer.getUserId());
        order.verify(membersRepository).deleteByUserId(developer.getUserId());
        order.verify(projectsRepository).clearDefaultAssignee(developer.getUserId());
        order.verify(issuesRepository).deleteByReporterOrAssignee(developer.getUserId());
        order.verify(usersRepository).delete(developer);
    }

    @Test
    void onlyAdminsDelete() {
        assertThatThrownBy(() -> userService.deleteUser(developer.getUserId(), manager))
                .isInstanceOf(ForbiddenOperationException.class);
        verify(usersRepository, never()).delete(any());
    }
}
