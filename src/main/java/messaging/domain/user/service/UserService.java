package messaging.domain.user.service;

import lombok.RequiredArgsConstructor;
import messaging.domain.user.dto.UserSummaryResponse;
import messaging.domain.user.repository.UserRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;

    /**
     * DM 상대 선택, 멤버 추가에 쓰는 사용자 목록. 요청자 본인은 제외하고 이름 순으로 정렬한다.
     */
    @Transactional(readOnly = true)
    public List<UserSummaryResponse> listUsers(Long excludingUserId) {
        return userRepository.findAllByIdNotOrderByNameAsc(excludingUserId).stream()
                .map(UserSummaryResponse::from)
                .toList();
    }
}
