package io.github.mandar2812.cdfio;

/**
 * Result of looking up a single attribute entry.
 *
 * @since    28 Jun 2013
 */
public class AttributeData {

    private final DataType dataType_;
    private final int itemSize_;
    private final int numItems_;
    private final Object data_;

    /**
     * Constructor.
     *
     * @param  dataType  entry data type
     * @param  itemSize  bytes per item (string length for character types)
     * @param  numItems  element count, or number of strings for
     *                   character entries
     * @param  data  flat value array, or String / String[] for
     *               character entries
     */
    public AttributeData( DataType dataType, int itemSize, int numItems,
                          Object data ) {
        dataType_ = dataType;
        itemSize_ = itemSize;
        numItems_ = numItems;
        data_ = data;
    }

    public DataType getDataType() {
        return dataType_;
    }

    /**
     * Returns the data type token.
     *
     * @return  for instance "CDF_CHAR"
     */
    public String getDataTypeToken() {
        return dataType_.getToken();
    }

    public int getItemSize() {
        return itemSize_;
    }

    public int getNumItems() {
        return numItems_;
    }

    public Object getData() {
        return data_;
    }

    /**
     * Returns this entry as an AttributeEntry.
     *
     * @return  entry
     */
    public AttributeEntry toEntry() {
        return new AttributeEntry( dataType_, data_ );
    }

    @Override
    public String toString() {
        return dataType_.getToken() + "[" + numItems_ + "]: " + toEntry();
    }
}
