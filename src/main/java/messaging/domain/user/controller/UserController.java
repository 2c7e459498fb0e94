package messaging.domain.user.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import messaging.domain.user.dto.UserSummaryResponse;
import messaging.domain.user.service.UserService;
import messaging.global.config.CustomUserDetails;
import messaging.global.dto.ApiResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Tag(name = "사용자 API")
@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    @Operation(summary = "사용자 목록", description = "본인을 제외한 사용자를 이름 순으로 반환합니다.")
    @GetMapping
    public ResponseEntity<ApiResponse<List<UserSummaryResponse>>> listUsers(
            @AuthenticationPrincipal CustomUserDetails principal
    ) {
        return ResponseEntity.ok(ApiResponse.success(userService.listUsers(principal.getUserId())));
    }
}
