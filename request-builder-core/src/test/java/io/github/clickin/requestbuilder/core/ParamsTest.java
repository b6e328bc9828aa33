package io.github.clickin.requestbuilder.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParamsTest {

    @Test
    void addKeepsMostRecentValueFirst() {
        Params params = Params.create()
                .add("tag", "first")
                .add("tag", "second");
        assertThat(params.get("tag")).containsExactly("second", "first");
    }

    @Test
    void ofKeepsLastPairForDuplicateNames() {
        Params params = Params.of(List.of(Map.entry("a", "1"), Map.entry("a", "2"), Map.entry("b", "3")));
        assertThat(params.get("a")).containsExactly("2");
        assertThat(params.get("b")).containsExactly("3");
    }

    @Test
    void replaceAllDropsPreviousEntries() {
        Params params = Params.create().add("old", "x").add("old", "y");
        params.replaceAll(List.of(Map.entry("new", "z")));
        assertThat(params.names()).containsExactly("new");
        assertThat(params.contains("old")).isFalse();
    }

    @Test
    void namesIterateInAscendingOrder() {
        Params params = Params.create().add("zeta", "1").add("alpha", "2").add("mid", "3");
        assertThat(params.names()).containsExactly("alpha", "mid", "zeta");
    }

    @Test
    void copyOfIsReadOnly() {
        Params source = Params.create().add("a", "1");
        Params copy = Params.copyOf(source);
        source.add("a", "2");

        assertThat(copy.get("a")).containsExactly("1");
        assertThat(Params.copyOf(copy)).isSameAs(copy);
        assertThatThrownBy(() -> copy.add("a", "3"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void emptyNamesAndValuesAreAccepted() {
        Params params = Params.create().add("", "");
        assertThat(params.get("")).containsExactly("");
    }

    @Test
    void fileParamsDetectCompoundFields() {
        FileParams files = FileParams.of(List.of(Map.entry("photo", FileUpload.of("a.png", "A"))));
        assertThat(files.isCompound("photo")).isFalse();

        files.add("photo", FileUpload.of("b.png", "B"));
        assertThat(files.isCompound("photo")).isTrue();
        assertThat(files.get("photo")).extracting(FileUpload::filename).containsExactly("b.png", "a.png");
    }

    @Test
    void fileUploadComparesContent() {
        assertThat(FileUpload.of("a.txt", "hello")).isEqualTo(new FileUpload("a.txt", "hello".getBytes()));
        assertThat(FileUpload.of("a.txt", "hello").length()).isEqualTo(5);
    }
}
