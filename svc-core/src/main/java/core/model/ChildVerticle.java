package core.model;

public record ChildVerticle( String vertName, String id )
{
}
