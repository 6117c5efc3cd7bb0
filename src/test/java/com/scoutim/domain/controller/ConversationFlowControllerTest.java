package com.scoutim.domain.controller;

import com.baomidou.mybatisplus.core.toolkit.IdWorker;
import com.jayway.jsonpath.JsonPath;
import com.scoutim.auth.service.JwtService;
import com.scoutim.common.api.ApiCodes;
import com.scoutim.domain.entity.UserEntity;
import com.scoutim.domain.mapper.UserMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class ConversationFlowControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private JwtService jwtService;

    @Autowired
    private UserMapper userMapper;

    @Test
    void openDm_Send_RecipientSeesUnread_ThenReads() throws Exception {
        long alice = newUser("alice");
        String bobName = "bob" + IdWorker.getId();
        long bob = newUser(bobName);

        String opened = mockMvc.perform(post("/dm")
                        .header("Authorization", bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientUsername\":\"" + bobName + "\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.counterpartId").value(String.valueOf(bob)))
                .andReturn().getResponse().getContentAsString();
        String threadId = JsonPath.read(opened, "$.data.threadId");

        mockMvc.perform(post("/dm/" + threadId + "/messages")
                        .header("Authorization", bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"trade talk?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.body").value("trade talk?"))
                .andExpect(jsonPath("$.data.mine").value(true));

        mockMvc.perform(get("/threads").header("Authorization", bearer(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].threadId").value(threadId))
                .andExpect(jsonPath("$.data[0].unreadCount").value(1))
                .andExpect(jsonPath("$.data[0].lastMessage.body").value("trade talk?"));

        mockMvc.perform(get("/threads/unread").header("Authorization", bearer(bob)))
                .andExpect(jsonPath("$.data.unreadCount").value(1));

        mockMvc.perform(get("/dm/" + threadId).header("Authorization", bearer(bob)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.markedRead").value(1))
                .andExpect(jsonPath("$.data.messages[0].mine").value(false));

        mockMvc.perform(get("/threads/unread").header("Authorization", bearer(bob)))
                .andExpect(jsonPath("$.data.unreadCount").value(0));
    }

    @Test
    void outsider_IsForbidden() throws Exception {
        long alice = newUser("alice");
        String bobName = "bob" + IdWorker.getId();
        newUser(bobName);
        long eve = newUser("eve");

        String opened = mockMvc.perform(post("/dm")
                        .header("Authorization", bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientUsername\":\"" + bobName + "\"}"))
                .andReturn().getResponse().getContentAsString();
        String threadId = JsonPath.read(opened, "$.data.threadId");

        mockMvc.perform(post("/threads/" + threadId + "/messages")
                        .header("Authorization", bearer(eve))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"hello\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value(ApiCodes.FORBIDDEN));
    }

    @Test
    void blankBody_IsBadRequest() throws Exception {
        long alice = newUser("alice");

        mockMvc.perform(post("/threads/" + IdWorker.getId() + "/messages")
                        .header("Authorization", bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(ApiCodes.BAD_REQUEST));
    }

    @Test
    void unknownRecipient_IsNotFound() throws Exception {
        long alice = newUser("alice");

        mockMvc.perform(post("/dm")
                        .header("Authorization", bearer(alice))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"recipientUsername\":\"nobody-" + IdWorker.getId() + "\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ApiCodes.NOT_FOUND));
    }

    @Test
    void subjectThread_UnknownOwnerIsNotFound_AndDmRoutesRejectIt() throws Exception {
        long owner = newUser("owner");
        long scout = newUser("scout");
        long subjectId = IdWorker.getId();

        mockMvc.perform(post("/threads/subject/" + subjectId)
                        .header("Authorization", bearer(scout))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":" + IdWorker.getId() + "}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(ApiCodes.NOT_FOUND));

        String opened = mockMvc.perform(post("/threads/subject/" + subjectId)
                        .header("Authorization", bearer(scout))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"ownerId\":" + owner + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.ownerId").value(String.valueOf(owner)))
                .andReturn().getResponse().getContentAsString();
        String threadId = JsonPath.read(opened, "$.data.threadId");

        mockMvc.perform(get("/dm/" + threadId).header("Authorization", bearer(scout)))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/dm/" + threadId + "/messages")
                        .header("Authorization", bearer(scout))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"hello\"}"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/threads/" + threadId + "/messages")
                        .header("Authorization", bearer(scout))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"body\":\"is he available?\"}"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/threads/unread").header("Authorization", bearer(owner)))
                .andExpect(jsonPath("$.data.unreadCount").value(1));
    }

    @Test
    void withoutToken_IsUnauthorized() throws Exception {
        mockMvc.perform(get("/threads"))
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.code").value(ApiCodes.UNAUTHORIZED));

        mockMvc.perform(get("/threads").header("Authorization", "Bearer broken"))
                .andExpect(status().isUnauthorized());
    }

    private String bearer(long userId) {
        return "Bearer " + jwtService.issueAccessToken(userId);
    }

    private long newUser(String name) {
        long id = IdWorker.getId();
        userMapper.insert(UserEntity.builder()
                .id(id)
                .loginName(name + "-" + id)
                .username(name)
                .createdAt(LocalDateTime.now())
                .build());
        return id;
    }
}
