package hostedauth.core.service.flow;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Optional;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import hostedauth.core.model.error.CallbackParseException;
import hostedauth.core.model.flow.ResponseParameters;

@DisplayName("CallbackResponseParser")
class CallbackResponseParserTest {

    private final CallbackResponseParser parser = new CallbackResponseParser();

    @Nested
    @DisplayName("parseFragment")
    class ParseFragment {

        @Test
        @DisplayName("should read tokens from the fragment")
        void shouldReadTokensFromFragment() {
            var params = parser.parseFragment(
                    "https://app.example.com/callback#id_token=id1&access_token=at1&state=s1&token_type=Bearer");

            assertEquals(Optional.of("id1"), params.get(ResponseParameters.ID_TOKEN));
            assertEquals(Optional.of("at1"), params.get(ResponseParameters.ACCESS_TOKEN));
            assertEquals(Optional.of("s1"), params.get(ResponseParameters.STATE));
        }

        @Test
        @DisplayName("should percent-decode values")
        void shouldDecodeValues() {
            var params = parser.parseFragment("https://app/cb#error=access_denied&error_description=User%20cancelled");

            assertEquals(Optional.of("User cancelled"), params.get(ResponseParameters.ERROR_DESCRIPTION));
        }

        @Test
        @DisplayName("should keep a literal plus sign in token values")
        void shouldKeepLiteralPlus() {
            var params = parser.parseFragment("https://app/cb#refresh_token=ab+cd/ef==&state=a%2Bb");

            assertEquals(Optional.of("ab+cd/ef=="), params.get(ResponseParameters.REFRESH_TOKEN));
            assertEquals(Optional.of("a+b"), params.get(ResponseParameters.STATE));
        }

        @Test
        @DisplayName("should keep undecodable values as they are")
        void shouldKeepUndecodableValues() {
            var params = parser.parseFragment("https://app/cb#state=50%zz");

            assertEquals(Optional.of("50%zz"), params.get(ResponseParameters.STATE));
        }

        @Test
        @DisplayName("should skip empty pairs and map bare keys to empty values")
        void shouldHandleOddPairs() {
            var params = parser.parseFragment("https://app/cb#&flag&a=1&&b=x=y");

            assertEquals(Optional.of(""), params.get("flag"));
            assertEquals(Optional.of("1"), params.get("a"));
            assertEquals(Optional.of("x=y"), params.get("b"));
            assertFalse(params.has(""));
        }

        @Test
        @DisplayName("should fail without a fragment")
        void shouldFailWithoutFragment() {
            assertThrows(CallbackParseException.class, () -> parser.parseFragment("https://app/cb?code=abc"));
            assertThrows(CallbackParseException.class, () -> parser.parseFragment(null));
        }
    }

    @Nested
    @DisplayName("parseQuery")
    class ParseQuery {

        @Test
        @DisplayName("should read the code from the query")
        void shouldReadCode() {
            var params = parser.parseQuery("https://app/cb?code=abc&state=s1");

            assertEquals(Optional.of("abc"), params.get(ResponseParameters.CODE));
            assertEquals(Optional.of("s1"), params.get(ResponseParameters.STATE));
        }

        @Test
        @DisplayName("should drop a trailing fragment")
        void shouldDropFragment() {
            var params = parser.parseQuery("https://app/cb?code=abc#_=_");

            assertEquals(Optional.of("abc"), params.get(ResponseParameters.CODE));
            assertFalse(params.has("_"));
        }

        @Test
        @DisplayName("should fail without a query")
        void shouldFailWithoutQuery() {
            assertThrows(CallbackParseException.class, () -> parser.parseQuery("https://app/cb#code=abc"));
        }
    }
}
