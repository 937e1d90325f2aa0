package io.kvlink.field;

import io.kvlink.core.SchemaException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldChainTest {

    @Test
    void takesTypeFromFirstStage() {
        FieldChain chain = new FieldChain("n", List.of(new IntegerField(""), new Base64Field("")));

        assertThat(chain.fieldType()).isEqualTo(FieldType.INTEGER);
        assertThat(chain.valueType()).isEqualTo(Long.class);
        assertThat(chain.fromStorage(chain.toStorage(12345L))).isEqualTo(12345L);
    }

    @Test
    void sentinelShortCircuitsOnLoad() {
        FieldChain chain = new FieldChain("n", List.of(new IntegerField(""), new Base64Field("")));

        assertThat(chain.fromStorage(new byte[0])).isSameAs(NullSentinel.INSTANCE);
        assertThat(chain.toStorage(NullSentinel.INSTANCE)).isEmpty();
    }

    @Test
    void laterStagesMustBeByteTyped() {
        assertThatThrownBy(() -> new FieldChain("bad", List.of(new StringField(""), new IntegerField(""))))
                .isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> new FieldChain("bad", List.of()))
                .isInstanceOf(SchemaException.class);
        assertThatThrownBy(() -> new FieldChain("bad", List.of(new ForeignLinkField("", "Other"))))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void indexableOnlyIfEveryStageIs() {
        FieldChain withBytes = new FieldChain("b", List.of(new StringField(""), new BytesField("")));
        FieldChain withBase64 = new FieldChain("b", List.of(new StringField(""), new Base64Field("")));

        assertThat(withBytes.canIndex()).isFalse();
        assertThat(withBase64.canIndex()).isTrue();
        assertThat(withBase64.isIndexHashed()).isFalse();
    }
}
