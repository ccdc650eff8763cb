package app.kartoteka.exchange.service.parser;

import java.io.Closeable;
import java.util.List;

public interface ImportStream extends Closeable {
    List<String> fields();

    boolean hasNext();

    ImportRecord next();
}
