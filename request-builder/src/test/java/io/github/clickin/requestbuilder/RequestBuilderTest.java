package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.FileUpload;
import io.github.clickin.requestbuilder.core.HttpMethod;
import io.github.clickin.requestbuilder.core.MockRequest;
import io.github.clickin.requestbuilder.core.Protocol;
import io.github.clickin.requestbuilder.core.ServerDefaults;
import io.github.clickin.requestbuilder.spi.MimeTypes;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RequestBuilderTest {

    @Test
    void defaultDraftBuildsBareGet() {
        MockRequest request = RequestBuilder.create().build();

        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.uri()).isEmpty();
        assertThat(request.queryString()).isEmpty();
        assertThat(request.headers().isEmpty()).isTrue();
        assertThat(request.body()).isEmpty();
        assertThat(request.contentLength()).isEmpty();
        assertThat(request.isSecure()).isFalse();
    }

    @Test
    void getFoldsParamsIntoUri() {
        MockRequest request = RequestBuilder.buildRequest(rb -> rb
                .get("/posts", List.of(Map.entry("ordered", "1")))
                .setHeader("Accept", "application/json"));

        assertThat(request.method()).isEqualTo(HttpMethod.GET);
        assertThat(request.uri()).isEqualTo("/posts?ordered=1");
        assertThat(request.queryString()).isEqualTo("ordered=1");
        assertThat(request.header(Protocol.H_CONTENT_TYPE)).contains("x-www-form-urlencoded");
        assertThat(request.header("accept")).contains("application/json");
        assertThat(request.contentLength()).isEmpty();
    }

    @Test
    void addParamOnGetStillReachesQueryString() {
        MockRequest request = RequestBuilder.create()
                .setURI("/search")
                .addParam("q", "first")
                .addParam("q", "second")
                .build();

        assertThat(request.params().get("q")).containsExactly("second", "first");
        assertThat(request.uri()).isEqualTo("/search?q=second&q=first");
        assertThat(request.body()).isEmpty();
    }

    @Test
    void postUrlEncodedBuildsFormBody() {
        MockRequest request = RequestBuilder.buildRequest(rb -> rb
                .postUrlEncoded("/authenticate", List.of(
                        Map.entry("login", "john@doe.com"),
                        Map.entry("password", "s3cret pass"))));

        String expected = "login=john%40doe.com&password=s3cret%20pass";
        assertThat(request.method()).isEqualTo(HttpMethod.POST);
        assertThat(request.uri()).isEqualTo("/authenticate");
        assertThat(request.queryString()).isEmpty();
        assertThat(request.bodyAsString()).isEqualTo(expected);
        assertThat(request.contentLength()).hasValue(expected.length());
    }

    @Test
    void postMultipartSetsBoundaryHeaderAndBody() {
        RequestBuilderConfig config = RequestBuilderConfig.builder()
                .randomSource(TestRandomSources.counting())
                .build();

        MockRequest request = RequestBuilder.buildRequest(config, rb -> rb
                .postMultipart("/picture/upload",
                        List.of(Map.entry("caption", "Sunset")),
                        List.of(Map.entry("photo", FileUpload.of("photo.jpg", "JPEG")))));

        String b = TestRandomSources.boundary(1);
        String expected = "--" + b + "\r\n"
                + "Content-Disposition: form-data; name=\"caption\"\r\n\r\n"
                + "Sunset\r\n"
                + "--" + b + "\r\n"
                + "Content-Disposition: form-data; name=\"photo\"; filename=\"photo.jpg\"\r\n"
                + "Content-Type: image/jpeg\r\n\r\n"
                + "JPEG\r\n"
                + "--" + b + "--";

        assertThat(request.header(Protocol.H_CONTENT_TYPE)).contains("multipart/form-data; boundary=" + b);
        assertThat(request.bodyAsString()).isEqualTo(expected);
        assertThat(request.contentLength()).hasValue(expected.getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    void addFileParamBuildsCompoundField() {
        RequestBuilderConfig config = RequestBuilderConfig.builder()
                .randomSource(TestRandomSources.counting())
                .build();

        MockRequest request = RequestBuilder.create(config)
                .multipartEncoded()
                .setMethod(HttpMethod.POST)
                .setURI("/attachments")
                .addFileParam("files", "one.txt", "1".getBytes())
                .addFileParam("files", "two.txt", "2".getBytes())
                .build();

        String body = request.bodyAsString();
        String fb = TestRandomSources.boundary(2);
        assertThat(body).contains("Content-Type: multipart/mixed; boundary=" + fb + "\r\n");
        assertThat(body).contains("--" + fb + "\r\nContent-Disposition: files; filename=\"two.txt\"\r\n");
        assertThat(body).contains("--" + fb + "\r\nContent-Disposition: files; filename=\"one.txt\"\r\n");
        assertThat(body.indexOf("two.txt")).isLessThan(body.indexOf("one.txt"));
        assertThat(body).doesNotContain("form-data; files");
    }

    @Test
    void putSendsRawBody() {
        MockRequest request = RequestBuilder.buildRequest(rb -> rb
                .put("/items/1", "application/json", "{\"name\":\"x\"}".getBytes(StandardCharsets.UTF_8)));

        assertThat(request.method()).isEqualTo(HttpMethod.PUT);
        assertThat(request.header(Protocol.H_CONTENT_TYPE)).contains("application/json");
        assertThat(request.bodyAsString()).isEqualTo("{\"name\":\"x\"}");
        assertThat(request.contentLength()).hasValue(12);
    }

    @Test
    void putDistinguishesMissingFromEmptyBody() {
        MockRequest missing = RequestBuilder.create().setMethod(HttpMethod.PUT).build();
        MockRequest empty = RequestBuilder.create().setMethod(HttpMethod.PUT).setRequestBody(new byte[0]).build();

        assertThat(missing.contentLength()).isEmpty();
        assertThat(empty.contentLength()).hasValue(0);
    }

    @Test
    void laterStepsOverrideEarlierOnes() {
        MockRequest request = RequestBuilder.create()
                .postMultipart("/a", List.of(), List.of())
                .formUrlEncoded()
                .setURI("/b")
                .setParams(List.of(Map.entry("x", "1")))
                .build();

        assertThat(request.uri()).isEqualTo("/b");
        assertThat(request.header(Protocol.H_CONTENT_TYPE)).contains("x-www-form-urlencoded");
        assertThat(request.bodyAsString()).isEqualTo("x=1");
    }

    @Test
    void setParamsReplacesAddedParams() {
        MockRequest request = RequestBuilder.create()
                .addParam("old", "1")
                .setParams(List.of(Map.entry("new", "2")))
                .build();

        assertThat(request.params().names()).containsExactly("new");
    }

    @Test
    void addHeaderAppendsAndSetHeaderReplaces() {
        MockRequest request = RequestBuilder.create()
                .addHeader("X-Forwarded-For", "10.0.0.1")
                .addHeader("x-forwarded-for", "10.0.0.2")
                .setHeader("Accept", "text/html")
                .setHeader("accept", "application/json")
                .build();

        assertThat(request.headers().get("X-Forwarded-For")).containsExactly("10.0.0.1", "10.0.0.2");
        assertThat(request.headers().get("Accept")).containsExactly("application/json");
    }

    @Test
    void filesOnUrlEncodedPostAreIgnored() {
        MockRequest request = RequestBuilder.create()
                .postUrlEncoded("/form", List.of(Map.entry("a", "1")))
                .setFileParams(List.of(Map.entry("f", FileUpload.of("a.txt", "A"))))
                .build();

        assertThat(request.bodyAsString()).isEqualTo("a=1");
    }

    @Test
    void useHttpsMarksRequestSecure() {
        MockRequest request = RequestBuilder.create().useHttps().build();
        assertThat(request.isSecure()).isTrue();
    }

    @Test
    void applyComposesReusableSteps() {
        Consumer<RequestBuilder> jsonClient = rb -> rb
                .setHeader("Accept", "application/json")
                .useHttps();

        MockRequest request = RequestBuilder.buildRequest(rb -> rb
                .apply(jsonClient)
                .get("/me", List.of()));

        assertThat(request.header("Accept")).contains("application/json");
        assertThat(request.isSecure()).isTrue();
        assertThat(request.uri()).isEqualTo("/me");
    }

    @Test
    void configSuppliesMimeTypesAndServerDefaults() {
        RequestBuilderConfig config = RequestBuilderConfig.builder()
                .randomSource(TestRandomSources.counting())
                .mimeTypes(MimeTypes.defaults().with(".dat", "application/x-dat"))
                .serverDefaults(ServerDefaults.builder().serverName("example.org").build())
                .build();

        MockRequest request = RequestBuilder.create(config)
                .postMultipart("/u", List.of(), List.of(Map.entry("f", FileUpload.of("x.dat", "D"))))
                .build();

        assertThat(request.bodyAsString()).contains("Content-Type: application/x-dat\r\n");
        assertThat(request.serverName()).isEqualTo("example.org");
    }

    @Test
    void snapshotReflectsDraftSoFar() {
        RequestBuilder builder = RequestBuilder.create()
                .setMethod(HttpMethod.DELETE)
                .setURI("/items/9")
                .setRequestBody("x".getBytes());

        DraftSnapshot snapshot = builder.snapshot();

        assertThat(snapshot.method()).isEqualTo(HttpMethod.DELETE);
        assertThat(snapshot.uri()).isEqualTo("/items/9");
        assertThat(snapshot.contentType()).isEqualTo(Protocol.CT_FORM_URLENCODED);
        assertThat(snapshot.body()).isEqualTo("x".getBytes());
    }

    @Test
    void builderIsSingleUse() {
        RequestBuilder builder = RequestBuilder.create();
        builder.build();

        assertThatThrownBy(builder::build).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> builder.addParam("a", "1")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void laterMutationsDoNotLeakIntoBuiltRequest() {
        byte[] body = "abc".getBytes();
        MockRequest request = RequestBuilder.create()
                .setMethod(HttpMethod.PUT)
                .setRequestBody(body)
                .build();
        body[0] = 'z';

        assertThat(request.bodyAsString()).isEqualTo("abc");
    }
}
