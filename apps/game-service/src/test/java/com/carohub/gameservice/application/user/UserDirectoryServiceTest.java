package com.carohub.gameservice.application.user;

import com.carohub.gameservice.infrastructure.client.system.SystemUserClient;
import com.carohub.web.common.ApiResponse;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class UserDirectoryServiceTest {

    @Mock
    private SystemUserClient systemUserClient;

    @InjectMocks
    private UserDirectoryService service;

    @Test
    void shouldReturnProfileOnSuccess() {
        UserProfileView view = UserProfileView.builder().userId("alice").username("alice01").build();
        when(systemUserClient.getUserInfo("alice")).thenReturn(ApiResponse.success(view));

        UserProfileView found = service.getUserInfo("alice");

        assertEquals("alice01", found.getDisplayName());
    }

    @Test
    void shouldTreatErrorResponseAsMissing() {
        when(systemUserClient.getUserInfo("ghost")).thenReturn(ApiResponse.notFound("no such user"));

        assertNull(service.getUserInfo("ghost"));
    }

    @Test
    void shouldSkipBlankIds() {
        assertNull(service.getUserInfo(" "));
        verifyNoInteractions(systemUserClient);
    }

    @Test
    void shouldPreferNicknameAndFallBackToGivenName() {
        UserProfileView withNick = UserProfileView.builder().userId("a").username("u").nickname("Nick").build();

        assertEquals("Nick", UserProfileView.displayNameOr(withNick, "a"));
        assertEquals("fallback", UserProfileView.displayNameOr(null, "fallback"));
    }
}
