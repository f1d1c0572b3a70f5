package com.cadastral.lookup.module.test.support;

import com.cadastral.lookup.application.port.out.QueryHistoryRepository;
import com.cadastral.lookup.application.service.UserAccountService;
import com.cadastral.lookup.domain.model.QueryHistory;
import com.cadastral.lookup.domain.model.User;
import com.cadastral.lookup.infrastructure.security.JwtTokenService;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Test data builder for integration tests: accounts, tokens and history rows.
 */
@Component
public class TestDataBuilder {

    private final UserAccountService userAccountService;
    private final QueryHistoryRepository queryHistoryRepository;
    private final JwtTokenService jwtTokenService;

    public TestDataBuilder(
            UserAccountService userAccountService,
            QueryHistoryRepository queryHistoryRepository,
            JwtTokenService jwtTokenService) {
        this.userAccountService = userAccountService;
        this.queryHistoryRepository = queryHistoryRepository;
        this.jwtTokenService = jwtTokenService;
    }

    public User user(String email) {
        return userAccountService.register(email, TestFixtures.Common.PASSWORD);
    }

    public User superuser(String email) {
        return userAccountService.register(email, TestFixtures.Common.PASSWORD, true);
    }

    public String bearer(User user) {
        return "Bearer " + jwtTokenService.issueToken(user.getId());
    }

    /**
     * Insert history rows for the user in the given order; the last one is the newest.
     */
    public List<QueryHistory> history(User user, String... cadastralNumbers) {
        List<QueryHistory> saved = new ArrayList<>();
        for (String cadastralNumber : cadastralNumbers) {
            saved.add(queryHistoryRepository.saveAndFlush(
                    TestFixtures.queryHistory(user.getId(), cadastralNumber, false)));
        }
        return saved;
    }
}
