package app.kartoteka.exchange.service.parser;

import java.io.IOException;
import java.io.InputStream;

public interface ImportParser {

    ImportStream openStream(InputStream inputStream, ParseOptions options) throws IOException;

    default int countRows(InputStream inputStream, ParseOptions options) throws IOException {
        int count = 0;
        try (ImportStream stream = openStream(inputStream, options)) {
            while (stream.hasNext()) {
                stream.next();
                count++;
            }
        }
        return count;
    }
}
