package com.dockerlab.repository;

import com.dockerlab.model.User;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentMatchers;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;

/**
 * A row removed by another request between the lookup and the delete.
 */
@ExtendWith(MockitoExtension.class)
class UserRepositoryDeleteRaceTest {

    @Mock
    private NamedParameterJdbcTemplate jdbc;

    @InjectMocks
    private UserRepository userRepository;

    private void givenRowStillVisible(User user) {
        given(jdbc.query(anyString(), any(SqlParameterSource.class), ArgumentMatchers.<RowMapper<User>>any()))
            .willReturn(List.of(user));
    }

    @Test
    @DisplayName("delete that removes no row reports the user as gone")
    void concurrentDeleteWins() {
        givenRowStillVisible(User.builder().id(7L).name("Juan").email("juan@example.com")
            .createdAt(LocalDateTime.now()).build());
        given(jdbc.update(anyString(), any(SqlParameterSource.class))).willReturn(0);

        assertThat(userRepository.deleteById(7)).isEmpty();
    }

    @Test
    @DisplayName("delete that removes the row returns it")
    void deleteRemovesRow() {
        User user = User.builder().id(7L).name("Juan").email("juan@example.com")
            .createdAt(LocalDateTime.now()).build();
        givenRowStillVisible(user);
        given(jdbc.update(anyString(), any(SqlParameterSource.class))).willReturn(1);

        assertThat(userRepository.deleteById(7)).contains(user);
    }
}
