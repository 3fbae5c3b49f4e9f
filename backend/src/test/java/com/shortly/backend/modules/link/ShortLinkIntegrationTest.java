package com.shortly.backend.modules.link;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.flash;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.redirectedUrl;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.shortly.backend.support.AbstractPostgresIntegrationTest;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class ShortLinkIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void ownerCreatesListsAndFollowsLink() throws Exception {
        Cookie ada = accessCookie("ada@example.com");

        mockMvc.perform(post("/links").cookie(ada)
                        .param("url", "https://example.com/docs")
                        .param("shortCode", "docs"))
                .andExpect(redirectedUrl("/"));

        mockMvc.perform(get("/").cookie(ada))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.user.email").value("ada@example.com"))
                .andExpect(jsonPath("$.links[0].shortCode").value("docs"));

        mockMvc.perform(get("/docs"))
                .andExpect(status().isFound())
                .andExpect(redirectedUrl("https://example.com/docs"));
    }

    @Test
    void takenShortCodeFlashesError() throws Exception {
        Cookie ada = accessCookie("ada@example.com");
        Cookie grace = accessCookie("grace@example.com");

        mockMvc.perform(post("/links").cookie(ada).param("url", "https://example.com").param("shortCode", "home"))
                .andExpect(redirectedUrl("/"));
        mockMvc.perform(post("/links").cookie(grace).param("url", "https://example.org").param("shortCode", "home"))
                .andExpect(redirectedUrl("/"))
                .andExpect(flash().attribute("errors", "Url with that shortcode already exists, please choose another"));
    }

    @Test
    void anonymousCreateGoesToLoginAndInvalidUrlIsFlashed() throws Exception {
        mockMvc.perform(post("/links").param("url", "https://example.com"))
                .andExpect(redirectedUrl("/login"));

        mockMvc.perform(post("/links").cookie(accessCookie("ada@example.com")).param("url", "ftp://example.com"))
                .andExpect(redirectedUrl("/"))
                .andExpect(flash().attribute("errors", "Please enter a valid URL"));
    }

    @Test
    void onlyOwnerCanDelete() throws Exception {
        Cookie ada = accessCookie("ada@example.com");
        Cookie grace = accessCookie("grace@example.com");
        mockMvc.perform(post("/links").cookie(ada).param("url", "https://example.com").param("shortCode", "mine"))
                .andExpect(redirectedUrl("/"));
        String linkId = jdbcTemplate.queryForObject("SELECT id::text FROM short_link", String.class);

        mockMvc.perform(post("/links/{id}/delete", linkId).cookie(grace))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SHORT_LINK_NOT_FOUND"));
        mockMvc.perform(post("/links/{id}/delete", linkId).cookie(ada))
                .andExpect(redirectedUrl("/"));

        assertThat(jdbcTemplate.queryForObject("SELECT count(*) FROM short_link", Integer.class)).isZero();
    }

    @Test
    void ownerEditsLinkAndNewCodeRedirects() throws Exception {
        Cookie ada = accessCookie("ada@example.com");
        mockMvc.perform(post("/links").cookie(ada).param("url", "https://example.com/docs").param("shortCode", "docs"))
                .andExpect(redirectedUrl("/"));
        String linkId = jdbcTemplate.queryForObject("SELECT id::text FROM short_link", String.class);

        mockMvc.perform(get("/links/{id}/edit", linkId).cookie(ada))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.link.shortCode").value("docs"))
                .andExpect(jsonPath("$.link.url").value("https://example.com/docs"));

        mockMvc.perform(post("/links/{id}", linkId).cookie(ada)
                        .param("url", "https://example.com/guide")
                        .param("shortCode", "guide"))
                .andExpect(redirectedUrl("/"));

        mockMvc.perform(get("/guide"))
                .andExpect(redirectedUrl("https://example.com/guide"));
        mockMvc.perform(get("/docs"))
                .andExpect(status().isNotFound());
    }

    @Test
    void editRejectsTakenCodeAndForeignLinks() throws Exception {
        Cookie ada = accessCookie("ada@example.com");
        Cookie grace = accessCookie("grace@example.com");
        mockMvc.perform(post("/links").cookie(ada).param("url", "https://example.com").param("shortCode", "home"))
                .andExpect(redirectedUrl("/"));
        mockMvc.perform(post("/links").cookie(grace).param("url", "https://example.org").param("shortCode", "away"))
                .andExpect(redirectedUrl("/"));
        String graceLinkId = jdbcTemplate.queryForObject(
                "SELECT id::text FROM short_link WHERE short_code = 'away'", String.class);

        mockMvc.perform(post("/links/{id}", graceLinkId).cookie(grace)
                        .param("url", "https://example.org")
                        .param("shortCode", "home"))
                .andExpect(redirectedUrl("/links/" + graceLinkId + "/edit"))
                .andExpect(flash().attribute("errors", "Url with that shortcode already exists, please choose another"));

        mockMvc.perform(post("/links/{id}", graceLinkId).cookie(grace).param("url", "not a url"))
                .andExpect(redirectedUrl("/links/" + graceLinkId + "/edit"))
                .andExpect(flash().attribute("errors", "Please enter a valid URL"));

        mockMvc.perform(get("/links/{id}/edit", graceLinkId).cookie(ada))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/links/{id}", graceLinkId).cookie(ada).param("url", "https://evil.example"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SHORT_LINK_NOT_FOUND"));

        assertThat(jdbcTemplate.queryForObject(
                "SELECT url FROM short_link WHERE short_code = 'away'", String.class)).isEqualTo("https://example.org");
    }

    @Test
    void unknownShortCodeIsNotFound() throws Exception {
        mockMvc.perform(get("/missing"))
                .andExpect(status().isNotFound());
    }

    private Cookie accessCookie(String email) throws Exception {
        Cookie cookie = mockMvc.perform(post("/register")
                        .param("name", "Tester")
                        .param("email", email)
                        .param("password", "secret1"))
                .andExpect(redirectedUrl("/"))
                .andReturn()
                .getResponse()
                .getCookie("access_token");
        assertThat(cookie).isNotNull();
        return new Cookie("access_token", cookie.getValue());
    }
}
