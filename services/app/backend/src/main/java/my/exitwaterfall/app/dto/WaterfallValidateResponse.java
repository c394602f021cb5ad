package my.exitwaterfall.app.dto;

import java.util.List;

public record WaterfallValidateResponse(boolean valid, List<String> errors) {
}
