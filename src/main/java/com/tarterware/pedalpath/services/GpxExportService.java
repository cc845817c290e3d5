package com.tarterware.pedalpath.services;

import java.io.StringWriter;
import java.time.Instant;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;

import org.springframework.stereotype.Service;

import com.tarterware.pedalpath.models.Coordinate;
import com.tarterware.pedalpath.models.SavedRoute;
import com.tarterware.pedalpath.models.Waypoint;
import com.tarterware.pedalpath.utilities.StringUtilities;

/**
 * Writes saved routes as GPX 1.1: one {@code wpt} per waypoint and a single
 * track holding the route geometry.
 */
@Service
public class GpxExportService
{
    public static final String GPX_NAMESPACE = "http://www.topografix.com/GPX/1/1";

    public static final String GPX_CREATOR = "PedalPath";

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newInstance();

    /**
     * @param route The route to export.
     * @return the GPX document.
     */
    public String toGpx(SavedRoute route)
    {
        StringWriter out = new StringWriter();
        try
        {
            XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("gpx");
            xml.writeDefaultNamespace(GPX_NAMESPACE);
            xml.writeAttribute("version", "1.1");
            xml.writeAttribute("creator", GPX_CREATOR);

            xml.writeStartElement("metadata");
            writeText(xml, "name", route.getName());
            writeText(xml, "desc", route.getDescription());
            writeText(xml, "time", Instant.ofEpochMilli(route.getCreatedAtEpochMillis()).toString());
            xml.writeEndElement();

            if (route.getWaypoints() != null)
            {
                for (Waypoint waypoint : route.getWaypoints())
                {
                    xml.writeStartElement("wpt");
                    writePosition(xml, waypoint.getCoordinate());
                    writeText(xml, "name", waypoint.getName());
                    writeText(xml, "sym", waypoint.getKind().name());
                    xml.writeEndElement();
                }
            }

            xml.writeStartElement("trk");
            writeText(xml, "name", route.getName());
            xml.writeStartElement("trkseg");
            if (route.getGeometry() != null)
            {
                for (Coordinate coordinate : route.getGeometry())
                {
                    xml.writeEmptyElement("trkpt");
                    writePosition(xml, coordinate);
                }
            }
            xml.writeEndElement();
            xml.writeEndElement();

            xml.writeEndElement();
            xml.writeEndDocument();
            xml.close();
        }
        catch (XMLStreamException e)
        {
            throw new IllegalStateException("Unable to write GPX for route " + route.getId(), e);
        }

        return out.toString();
    }

    private static void writePosition(XMLStreamWriter xml, Coordinate coordinate) throws XMLStreamException
    {
        xml.writeAttribute("lat", Double.toString(coordinate.getLatitude()));
        xml.writeAttribute("lon", Double.toString(coordinate.getLongitude()));
    }

    private static void writeText(XMLStreamWriter xml, String element, String text) throws XMLStreamException
    {
        if (StringUtilities.isNullEmptyOrBlank(text))
        {
            return;
        }

        xml.writeStartElement(element);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }
}
