package my.compositeindex.app.dto;

public record StatusDto(boolean ok) {
	public static final StatusDto OK = new StatusDto(true);
}
