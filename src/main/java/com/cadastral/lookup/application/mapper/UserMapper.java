package com.cadastral.lookup.application.mapper;

import com.cadastral.lookup.api.dto.UserResponseDto;
import com.cadastral.lookup.domain.model.User;
import org.springframework.stereotype.Component;

@Component
public class UserMapper {

    public UserResponseDto toDto(User user) {
        return new UserResponseDto(
                user.getId(),
                user.getEmail(),
                user.isActive(),
                user.isVerified(),
                user.isSuperuser());
    }
}
