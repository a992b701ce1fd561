package org.harvest.traits.server;

import static io.restassured.RestAssured.given;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.hasItems;
import static org.hamcrest.Matchers.notNullValue;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import io.restassured.RestAssured;
import io.restassured.http.ContentType;
import io.restassured.parsing.Parser;

/**
 * Peer API over HTTP. The test profile configures the API key {@code test-secret}.
 */
@QuarkusTest
class ExtractionServerResourcesTest {

    @BeforeAll
    static void registerProblemJson() {
        RestAssured.registerParser("application/problem+json", Parser.JSON);
    }

    private static final String AUTH = "Bearer test-secret";

    @Test
    void testRootDescribesService() {
        given()
            .when().get("/")
            .then()
            .statusCode(200)
            .body("service", equalTo("HARVEST Trait Extraction Server"))
            .body("status", equalTo("running"));
    }

    @Test
    void testHealthNeedsNoKey() {
        given()
            .when().get("/health")
            .then()
            .statusCode(200)
            .body("status", equalTo("healthy"))
            .body("loaded_adapters", notNullValue());
    }

    @Nested
    @DisplayName("API key")
    class ApiKey {

        @Test
        void testMissingKeyIsUnauthorized() {
            given()
                .when().get("/models")
                .then()
                .statusCode(401)
                .header("WWW-Authenticate", "Bearer")
                .body("detail", equalTo("Missing authentication"));
        }

        @Test
        void testWrongKeyIsForbidden() {
            given()
                .header("Authorization", "Bearer not-the-key")
                .when().get("/models")
                .then()
                .statusCode(403)
                .body("detail", equalTo("Invalid API key"));
        }

        @Test
        void testValidKeyListsModels() {
            given()
                .header("Authorization", AUTH)
                .when().get("/models")
                .then()
                .statusCode(200)
                .body("id", hasItems("allennlp_srl", "huggingface_ner", "lasuie", "spacy_bio"));
        }
    }

    @Test
    void testExtractWithUnknownProfileIsBadRequest() {
        given()
            .header("Authorization", AUTH)
            .contentType(ContentType.JSON)
            .body("""
                {"documents": [{"id": 1, "text": "FLC delays flowering."}], "model_profile": "flair_ner"}
                """)
            .when().post("/extract_triples")
            .then()
            .statusCode(400)
            .body("detail", equalTo("Unknown model profile: flair_ner"));
    }

    @Test
    void testUnloadModelThatIsNotLoaded() {
        given()
            .header("Authorization", AUTH)
            .contentType(ContentType.JSON)
            .body("{\"model_profile\": \"spacy_bio\"}")
            .when().post("/unload_model")
            .then()
            .statusCode(200)
            .body("status", equalTo("success"))
            .body("message", equalTo("Model spacy_bio unloaded"));
    }

    @Test
    void testUnloadAllRequiresKey() {
        given()
            .when().post("/unload_all")
            .then()
            .statusCode(401);
    }
}
