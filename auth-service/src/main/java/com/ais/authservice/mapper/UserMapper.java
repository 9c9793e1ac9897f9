package com.ais.authservice.mapper;

import com.ais.authservice.dto.UserResponse;
import com.ais.authservice.model.User;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface UserMapper {

    /**
     * Public view of a user. The password hash and login method never leave the service.
     *
     * @param user the source entity
     * @return a mapped UserResponse dto
     */
    @Mapping(target = "role", expression = "java(user.getRole() != null ? user.getRole().getCode() : null)")
    UserResponse toUserResponse(User user);
}
