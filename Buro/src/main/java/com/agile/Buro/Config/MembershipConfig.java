package com.agile.Buro.Config;

import com.agile.Buro.Service.OpenMembershipLookup;
import com.agile.Buro.Service.ProjectMemberTableLookup;
import com.agile.Buro.Service.ProjectMembershipLookup;
import com.agile.Buro.repository.ProjectMembersRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class MembershipConfig {

    @Bean
    @ConditionalOnProperty(name = "buro.access.membership", havingValue = "project", matchIfMissing = true)
    public ProjectMembershipLookup projectMembershipLookup(ProjectMembersRepository membersRepository) {
        return new ProjectMemberTableLookup(membersRepository);
    }

    @Bean
    @ConditionalOnProperty(name = "buro.access.membership", havingValue = "open")
    public ProjectMembershipLookup openMembershipLookup() {
        log.warn("Project membership is open: every active user can access every project");
        return new OpenMembershipLookup();
    }
}
