package com.libragraph.unlock.formats.scheme;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ExtensionClassifierTest {

    private final ExtensionClassifier classifier = new ExtensionClassifier();

    @Test
    void shouldClassifyNcm() {
        assertThat(classifier.classifyByName("track.ncm")).contains("ncm");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "song.qmc0", "song.qmc3", "song.qmcflac", "song.qmcogg", "song.tkm",
            "song.mflac", "a.mflac0", "song.mgg", "song.mgg1", "song.mggl",
            "song.bkcmp3", "song.bkcm4a", "song.bkcflac", "song.bkcwav",
            "song.bkcape", "song.bkcogg", "song.bkcwma"
    })
    void shouldClassifyQmcVariants(String name) {
        assertThat(classifier.classifyByName(name)).contains("qmc");
    }

    @ParameterizedTest
    @ValueSource(strings = {"plain.mp3", "song.qmc1", "song.mflac1", "song.mgg2", "song.NCM", "ncm", ""})
    void shouldNotClassifyUnsupportedNames(String name) {
        assertThat(classifier.classifyByName(name)).isEmpty();
    }

    @Test
    void shouldReturnEmptyForNullName() {
        assertThat(classifier.classifyByName((String) null)).isEmpty();
    }

    @Test
    void shouldClassifyPathByFileName() {
        assertThat(classifier.classifyByName(Path.of("library", "qq", "song.mgg0"))).contains("qmc");
        assertThat(classifier.classifyByName(Path.of("/"))).isEmpty();
    }

    @Test
    void shouldListDefaultSchemesInOrder() {
        assertThat(classifier.schemes())
                .extracting(EncryptionScheme::name)
                .containsExactly(EncryptionScheme.NCM, EncryptionScheme.QMC);
    }

    @Test
    void shouldResolveOverlapsBySchemeOrder() {
        var first = new ExtensionClassifier(List.of(
                EncryptionScheme.of("specific", "*.qmcflac"),
                EncryptionScheme.of("generic", "*.qmc*")));
        var second = new ExtensionClassifier(List.of(
                EncryptionScheme.of("generic", "*.qmc*"),
                EncryptionScheme.of("specific", "*.qmcflac")));

        assertThat(first.classifyByName("x.qmcflac")).contains("specific");
        assertThat(second.classifyByName("x.qmcflac")).contains("generic");
    }

    @Test
    void shouldReportMatchingPattern() {
        var qmc = classifier.schemes().get(1);

        assertThat(qmc.matchingPattern("a.mflac0")).map(GlobPattern::pattern).contains("*.mflac[0]");
        assertThat(qmc.matchingPattern("a.mp3")).isEmpty();
    }

    @Test
    void shouldRejectSchemeWithoutPatterns() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> EncryptionScheme.of("empty"))
                .withMessageContaining("empty");
    }

    @Test
    void shouldReturnLastExtension() {
        assertThat(ExtensionClassifier.fileExtension("song.qmcflac")).isEqualTo(".qmcflac");
        assertThat(ExtensionClassifier.fileExtension("archive.tar.gz")).isEqualTo(".gz");
        assertThat(ExtensionClassifier.fileExtension("dir.d/track.ncm")).isEqualTo(".ncm");
        assertThat(ExtensionClassifier.fileExtension("name.")).isEqualTo(".");
    }

    @Test
    void shouldReturnEmptyExtensionWhenNoneApplies() {
        assertThat(ExtensionClassifier.fileExtension("README")).isEmpty();
        assertThat(ExtensionClassifier.fileExtension(".bashrc")).isEmpty();
        assertThat(ExtensionClassifier.fileExtension("...")).isEmpty();
        assertThat(ExtensionClassifier.fileExtension("dir.d/README")).isEmpty();
        assertThat(ExtensionClassifier.fileExtension("dir.d\\README")).isEmpty();
        assertThat(ExtensionClassifier.fileExtension("")).isEmpty();
    }
}
